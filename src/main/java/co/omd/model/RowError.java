package co.omd.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Fila excluida de los totales por un error de cálculo. */
public record RowError(
    @JsonProperty("indice")  int rowIndex,
    @JsonProperty("isin")    String identifier,
    @JsonProperty("mensaje") String message
) {}
