package co.omd.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/** Salida del escaneo del memorando. fecha_liquidacion puede ser null (no encontrada). */
public record ScanResult(
    @JsonProperty("fecha_liquidacion") LocalDate settlementDate,
    @JsonProperty("recogidos")         List<RawBondRecord> collected,
    @JsonProperty("entregados")        List<RawBondRecord> delivered
) {

  public ScanResult {
    collected = List.copyOf(collected);
    delivered = List.copyOf(delivered);
  }
}
