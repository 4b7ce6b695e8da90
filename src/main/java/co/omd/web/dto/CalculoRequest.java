package co.omd.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.util.List;

/**
 * Filas ya corregidas por el usuario. Cada título llega sin tipar y se convierte fila por fila,
 * así un valor ilegible omite esa fila y no la solicitud completa.
 * uvr/inflacion opcionales (si faltan se buscan).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalculoRequest {
  @JsonProperty("operacion_id")      public String operacionId;
  @JsonProperty("fecha_liquidacion") public LocalDate fechaLiquidacion;
  @JsonProperty("titulos")           public List<JsonNode> titulos;
  @JsonProperty("uvr")               public Double uvr;
  @JsonProperty("inflacion")         public Double inflacion;
}
