package com.image.ai.pipeline.controller;

import com.image.ai.shared.constant.APIMessages;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class StatusController {

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", APIMessages.API_WORKING);
    }
}
