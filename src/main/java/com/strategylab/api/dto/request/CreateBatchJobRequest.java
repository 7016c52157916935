package com.strategylab.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Request payload for creating a batch job.
 *
 * <p>{@code assignments} is normally the client's own enumeration; when omitted the server
 * enumerates the variable lists itself. {@code jobId} lets a client pick the id it already
 * stored its local mirror under.
 */
@Data
public class CreateBatchJobRequest {

    @Valid
    private List<VariableRequest> variables = new ArrayList<>();

    private List<Map<String, String>> assignments;

    private Boolean truncated;

    @NotNull
    @Valid
    private BaseStrategyRequest baseStrategy;

    @Size(max = 64)
    @Pattern(regexp = "^[A-Za-z0-9_-]+$", message = "may only contain letters, digits, '-' and '_'")
    private String jobId;

    @Size(max = 200)
    private String jobName;
}
