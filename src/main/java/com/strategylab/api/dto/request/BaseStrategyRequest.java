package com.strategylab.api.dto.request;

import com.strategylab.domain.model.Element;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import lombok.Data;

/**
 * The strategy every run of a batch starts from. Dates are {@code YYYY-MM-DD};
 * {@code startDate} may also be {@code max} for the full history.
 */
@Data
public class BaseStrategyRequest {

    @NotEmpty(message = "Elements array is required for batch strategy backtests")
    private List<Element> elements;

    private String benchmarkSymbol;

    @Pattern(regexp = "^(\\d{4}-\\d{2}-\\d{2}|max)$", message = "must be YYYY-MM-DD or max")
    private String startDate;

    @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "must be YYYY-MM-DD")
    private String endDate;
}
