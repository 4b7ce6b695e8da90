package co.omd.service.document;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/** Texto plano del memorando PDF, páginas separadas por salto de línea. */
@Service
public class PdfTextExtractor {

  public String extractText(InputStream pdf) throws IOException {
    try (PDDocument document = PDDocument.load(pdf)) {
      return extractText(document);
    }
  }

  public String extractText(PDDocument document) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setSortByPosition(true);
    StringBuilder sb = new StringBuilder();
    for (int p = 1; p <= document.getNumberOfPages(); p++) {
      stripper.setStartPage(p);
      stripper.setEndPage(p);
      sb.append(stripper.getText(document)).append('\n');
    }
    return sb.toString();
  }
}
