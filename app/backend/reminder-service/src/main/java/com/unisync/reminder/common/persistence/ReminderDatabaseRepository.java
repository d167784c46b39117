package com.unisync.reminder.common.persistence;

import com.unisync.reminder.common.entity.Reminder;
import com.unisync.reminder.common.repository.ReminderRepository;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Component
public class ReminderDatabaseRepository extends DatabaseRepository<Reminder, UUID, ReminderFilter> {

    public ReminderDatabaseRepository(ReminderRepository reminderRepository) {
        super(reminderRepository, reminderRepository);
    }

    @Override
    protected Specification<Reminder> toSpecification(ReminderFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.getId() != null) {
                predicates.add(cb.equal(root.get("id"), filter.getId()));
            }
            if (filter.getUserId() != null) {
                predicates.add(cb.equal(root.get("userId"), filter.getUserId()));
            }
            if (filter.getDate() != null) {
                predicates.add(cb.equal(root.get("date"), filter.getDate()));
            }
            if (filter.getStartDate() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("date"), filter.getStartDate()));
            }
            if (filter.getEndDate() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("date"), filter.getEndDate()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
