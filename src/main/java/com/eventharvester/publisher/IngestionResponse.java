package com.eventharvester.publisher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestionResponse {
    private int inserted;
    private int updated;
    private int failed;
    private int venuesCreated;
    private List<String> errors = new ArrayList<>();
}
