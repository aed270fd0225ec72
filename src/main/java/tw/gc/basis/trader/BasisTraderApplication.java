package tw.gc.basis.trader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BasisTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(BasisTraderApplication.class, args);
    }
}
