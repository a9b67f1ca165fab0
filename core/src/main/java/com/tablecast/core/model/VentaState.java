package com.tablecast.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Open sale on a table as returned by the POS API.
 * <p>
 * {@code updatedAt} is the revision marker: any change to the sale (items,
 * payments, state) moves it.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class VentaState {
    @JsonProperty("id")
    String id;

    @JsonProperty("estado")
    String estado;

    @JsonProperty("updatedAt")
    String updatedAt;
}
