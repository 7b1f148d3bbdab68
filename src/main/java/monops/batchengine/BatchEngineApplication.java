package monops.batchengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class BatchEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatchEngineApplication.class, args);
    }
}
