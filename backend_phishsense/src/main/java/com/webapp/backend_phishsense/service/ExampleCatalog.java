package com.webapp.backend_phishsense.service;

import com.webapp.backend_phishsense.dtos.ExampleMessageDto;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ExampleCatalog {
    private static final List<ExampleMessageDto> EXAMPLES = List.of(
            ExampleMessageDto.builder()
                    .title("Suspicious Email")
                    .text("Urgent: Your account has been suspended. Click here to verify your identity "
                            + "immediately or your funds will be lost.")
                    .build(),
            ExampleMessageDto.builder()
                    .title("Safe Message")
                    .text("Hi Mom, just checking in to see if you're coming over for dinner on Sunday. Let me know!")
                    .build()
    );

    public List<ExampleMessageDto> examples() {
        return EXAMPLES;
    }
}
