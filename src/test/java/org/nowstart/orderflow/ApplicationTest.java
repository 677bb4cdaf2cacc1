package org.nowstart.orderflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mockStatic;

import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

class ApplicationTest {

    @Test
    void main_startsOrderEngine() {
        String[] args = new String[] {"--server.port=0", "--orderflow.engine.recover-active-orders=false"};

        try (MockedStatic<SpringApplication> springApplication = mockStatic(SpringApplication.class)) {
            Application.main(args);

            springApplication.verify(() -> SpringApplication.run(Application.class, args));
        }
    }

    @Test
    void application_enablesAuditingAndPropertyScanning() {
        assertThat(Application.class.isAnnotationPresent(EnableJpaAuditing.class)).isTrue();
        assertThat(Application.class.isAnnotationPresent(ConfigurationPropertiesScan.class)).isTrue();
    }
}
