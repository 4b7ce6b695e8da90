package co.omd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "co.omd")
public class OmdApplication {
  public static void main(String[] args) {
    SpringApplication.run(OmdApplication.class, args);
  }
}
