package com.strategylab.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * A node of a strategy rule tree.
 *
 * <p>The {@code type} property selects the variant when a tree is read from JSON:
 * {@code ticker}, {@code weight}, {@code gate}, {@code scale} or {@code sort}.
 * Children are owned exclusively by their parent, so a tree never shares nodes.
 *
 * <p>Fields that accept variable tokens ({@code $name}) hold raw text; the same field
 * may carry a literal such as {@code "25"} or a token such as {@code "$w"}.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TickerElement.class, name = "ticker"),
    @JsonSubTypes.Type(value = WeightElement.class, name = "weight"),
    @JsonSubTypes.Type(value = GateElement.class, name = "gate"),
    @JsonSubTypes.Type(value = ScaleElement.class, name = "scale"),
    @JsonSubTypes.Type(value = SortElement.class, name = "sort"),
})
public abstract class Element {

    private String id;

    /** Allocation weight within the parent, as a number or a variable token. */
    private String weight;
}
