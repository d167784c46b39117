package com.unisync.reminder.home;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HomeController {

    @GetMapping("/")
    public Map<String, String> hello() {
        return Map.of("message", "Hello, World!");
    }
}
