package com.example.demo.deckgen.remote.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Acknowledgement of an applied batch; one reply per request, in order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchUpdateResponse {
    private String presentationId;
    private List<Map<String, Object>> replies = new ArrayList<>();
}
