package co.omd.web.dto;

import co.omd.model.ScanResult;
import com.fasterxml.jackson.annotation.JsonProperty;

public class MemorandoResponse {
  @JsonProperty("operacion_id") public String operacionId;
  @JsonProperty("memorando")    public ScanResult memorando;

  public static MemorandoResponse of(String operacionId, ScanResult scan) {
    MemorandoResponse r = new MemorandoResponse();
    r.operacionId = operacionId;
    r.memorando = scan;
    return r;
  }
}
