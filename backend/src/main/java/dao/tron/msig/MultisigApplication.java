package dao.tron.msig;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MultisigApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultisigApplication.class, args);
    }
}
