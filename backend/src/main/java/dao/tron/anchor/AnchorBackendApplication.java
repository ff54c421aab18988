package dao.tron.anchor;

import dao.tron.anchor.admin.AdminCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Map;

@SpringBootApplication
public class AnchorBackendApplication {

    public static void main(String[] args) {
        boolean admin = AdminCommandRunner.isAdminInvocation(args);
        SpringApplication app = new SpringApplication(AnchorBackendApplication.class);
        if (admin) {
            // one-shot commands never flush
            app.setDefaultProperties(Map.of("anchor.flush.enabled", "false"));
        }
        ConfigurableApplicationContext context = app.run(args);
        if (admin) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
