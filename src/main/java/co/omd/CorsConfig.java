package co.omd;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

/** CORS para el editor de correcciones (front separado). */
@Configuration
public class CorsConfig {

  // ENV: CORS_ALLOWED_ORIGINS="https://omd.example.gov.co,http://localhost:5173"
  @Value("${cors.allowed-origins:*}")
  private String allowedOriginsCsv;

  @Bean
  public WebMvcConfigurer corsConfigurer() {
    final String[] origins = parseOrigins(allowedOriginsCsv);
    return new WebMvcConfigurer() {
      @Override
      public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
            .allowedOriginPatterns(origins)
            .allowedMethods("GET", "POST", "OPTIONS")
            .allowedHeaders("*")
            // nombre de archivo de las descargas (informe / consolidado)
            .exposedHeaders(HttpHeaders.CONTENT_DISPOSITION)
            .allowCredentials(false)
            .maxAge(3600);
      }
    };
  }

  static String[] parseOrigins(String csv) {
    if (csv == null || csv.isBlank()) return new String[]{"*"};
    String[] out = Arrays.stream(csv.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toArray(String[]::new);
    return out.length == 0 ? new String[]{"*"} : out;
  }
}
