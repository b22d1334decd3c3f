package com.example.demo.deckgen.remote.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateTableRequest {
    private String objectId;
    private PageElementProperties elementProperties;
    private Integer rows;
    private Integer columns;
}
