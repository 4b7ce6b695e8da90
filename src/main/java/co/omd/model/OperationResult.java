package co.omd.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record OperationResult(
    @JsonProperty("titulos")     List<ValuedBond> bonds,
    @JsonProperty("totales")     OperationTotals totals,
    @JsonProperty("omitidos")    List<RowError> skipped,
    @JsonProperty("parametros")  ReferenceParameters parameters
) {

  public OperationResult {
    bonds = List.copyOf(bonds);
    skipped = List.copyOf(skipped);
  }

  public List<ValuedBond> byRole(BondRole role) {
    return bonds.stream().filter(b -> b.role() == role).toList();
  }
}
