package co.omd.service.pricing;

/** De dónde sale el precio sucio con el que se calcula el valor costo. */
public enum PriceBasis {
  /** Descontando flujos con la tasa del título. */
  MODEL,
  /** Precio sucio publicado en el memorando; AI por fórmula. */
  QUOTED
}
