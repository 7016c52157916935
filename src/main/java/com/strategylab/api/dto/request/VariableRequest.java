package com.strategylab.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/** A named value list as sent with a batch request. The leading {@code $} is optional. */
@Data
public class VariableRequest {

    @NotBlank
    private String name;

    private List<String> values = new ArrayList<>();
}
