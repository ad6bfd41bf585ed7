package gacha.expectation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GachaExpectationApplication {

  public static void main(String[] args) {
    SpringApplication.run(GachaExpectationApplication.class, args);
  }
}
