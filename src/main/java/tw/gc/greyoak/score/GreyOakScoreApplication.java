package tw.gc.greyoak.score;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.TimeZone;

@SpringBootApplication
public class GreyOakScoreApplication {

    static {
        // Stored asOf timestamps and snapshot dates are interpreted in IST
        TimeZone.setDefault(TimeZone.getTimeZone(AppConstants.MARKET_ZONE_ID));
    }

    public static void main(String[] args) {
        SpringApplication.run(GreyOakScoreApplication.class, args);
    }
}
