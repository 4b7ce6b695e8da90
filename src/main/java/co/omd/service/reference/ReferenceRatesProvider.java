package co.omd.service.reference;

import java.time.LocalDate;

/** Datos de mercado de referencia. Nunca lanza: ante ausencia devuelve el valor por defecto. */
public interface ReferenceRatesProvider {

  /** UVR vigente en la fecha. */
  double indexValue(LocalDate date);

  /** Inflación anual observada como fracción (0.052 = 5,2%). */
  double annualInflation(int year);
}
