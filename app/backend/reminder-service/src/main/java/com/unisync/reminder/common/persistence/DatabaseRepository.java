package com.unisync.reminder.common.persistence;

import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 엔티티 종류와 무관한 CRUD 기본 연산.
 *
 * <p>조회 조건은 엔티티별 필터 타입({@code F})으로 전달되며, 하위 클래스가
 * {@link #toSpecification(Object)}에서 JPA {@link Specification}으로 변환합니다.
 * 필터에 지정된 조건은 모두 AND로 결합되고, 비어 있는 필터는 전체와 일치합니다.</p>
 *
 * <p>어떤 연산도 "찾을 수 없음"에 대해 예외를 던지지 않습니다. 저장소 접근 실패는
 * {@link org.springframework.dao.DataAccessException} 그대로 전파됩니다.</p>
 *
 * @param <T>  엔티티 타입
 * @param <ID> 식별자 타입
 * @param <F>  필터 타입
 */
public abstract class DatabaseRepository<T, ID, F> {

    private final JpaRepository<T, ID> jpaRepository;
    private final JpaSpecificationExecutor<T> specificationExecutor;

    protected DatabaseRepository(JpaRepository<T, ID> jpaRepository,
                                 JpaSpecificationExecutor<T> specificationExecutor) {
        this.jpaRepository = jpaRepository;
        this.specificationExecutor = specificationExecutor;
    }

    /**
     * 필터를 쿼리 조건으로 변환
     */
    protected abstract Specification<T> toSpecification(F filter);

    /**
     * 엔티티를 저장하고 서버가 채운 필드(ID, 타임스탬프)가 포함된 인스턴스를 반환합니다.
     * 중복 여부는 확인하지 않습니다.
     */
    @Transactional
    public T create(T entity) {
        return jpaRepository.saveAndFlush(entity);
    }

    /**
     * 필터와 일치하는 첫 번째 엔티티
     */
    @Transactional(readOnly = true)
    public Optional<T> get(F filter) {
        return specificationExecutor.findBy(toSpecification(filter), query -> query.first());
    }

    /**
     * 필터와 일치하는 모든 엔티티 (저장소 기본 순서, 정렬 보장 없음)
     */
    @Transactional(readOnly = true)
    public List<T> filter(F filter) {
        return specificationExecutor.findAll(toSpecification(filter));
    }

    /**
     * 필터와 일치하는 첫 번째 엔티티를 삭제합니다. 일치하는 엔티티가 없으면 아무것도 하지 않습니다.
     *
     * @return 삭제가 일어났는지 여부
     */
    @Transactional
    public boolean delete(F filter) {
        Optional<T> found = get(filter);
        found.ifPresent(jpaRepository::delete);
        return found.isPresent();
    }

    /**
     * ID로 엔티티를 찾아 변경을 적용합니다. 엔티티가 없으면 아무것도 하지 않습니다.
     *
     * @return 변경된 엔티티, 없으면 empty
     */
    @Transactional
    public Optional<T> update(ID id, Consumer<T> changes) {
        return jpaRepository.findById(id)
                .map(entity -> {
                    changes.accept(entity);
                    return jpaRepository.saveAndFlush(entity);
                });
    }
}
