package co.omd.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

public final class OperationIds {
  private OperationIds(){}

  public static final String FALLBACK = "OMD_010125";

  private static final DateTimeFormatter DDMMYY = DateTimeFormatter.ofPattern("ddMMyy");

  /** OMD_ddMMyy de la fecha de liquidación. */
  public static String defaultFor(LocalDate settlement) {
    return settlement == null ? FALLBACK : "OMD_" + settlement.format(DDMMYY);
  }

  public static String orDefault(String operationId, LocalDate settlement) {
    return (operationId == null || operationId.isBlank()) ? defaultFor(settlement) : operationId.trim();
  }
}
