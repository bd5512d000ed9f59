package com.handyhub.bookingservice.config;

import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.ServiceProvider;
import com.handyhub.bookingservice.model.ServiceTask;
import com.handyhub.bookingservice.model.TimeBlock;
import com.handyhub.bookingservice.util.LocalDateTimeConverter;
import jakarta.persistence.EntityManagerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.orm.jpa.EntityManagerFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.orm.jpa.LocalContainerEntityManagerFactoryBean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.util.HashMap;
import java.util.Map;

@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(
    basePackages = "com.handyhub.bookingservice.repository",
    entityManagerFactoryRef = "entityManagerFactory",
    transactionManagerRef = "transactionManager"
)
public class BookingDatabaseConfig {

    private final String url;
    private final int busyTimeoutMillis;
    private final String ddlAuto;

    public BookingDatabaseConfig(DatabaseDirectoryInitializer databaseDirectoryInitializer,
                                 @Value("${booking.datasource.url:jdbc:sqlite:data/booking.db}") String url,
                                 @Value("${booking.datasource.busy-timeout-ms:60000}") int busyTimeoutMillis,
                                 @Value("${booking.datasource.ddl-auto:update}") String ddlAuto) {
        this.url = url;
        this.busyTimeoutMillis = busyTimeoutMillis;
        this.ddlAuto = ddlAuto;
        databaseDirectoryInitializer.ensureDirectoryFor(url);
    }

    @Bean(name = "dataSource")
    @Primary
    public DataSource dataSource() {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(busyTimeoutMillis);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl(url);
        return dataSource;
    }

    @Bean(name = "entityManagerFactory")
    @Primary
    public LocalContainerEntityManagerFactoryBean entityManagerFactory(
            EntityManagerFactoryBuilder builder,
            @Qualifier("dataSource") DataSource dataSource) {
        Map<String, String> properties = new HashMap<>();
        properties.put("hibernate.dialect", "org.hibernate.community.dialect.SQLiteDialect");
        properties.put("hibernate.hbm2ddl.auto", ddlAuto);
        properties.put("hibernate.show_sql", "false");
        properties.put("hibernate.format_sql", "true");
        properties.put("hibernate.jdbc.use_get_generated_keys", "false");

        return builder
            .dataSource(dataSource)
            .packages(
                Engagement.class,
                TimeBlock.class,
                ServiceProvider.class,
                ServiceTask.class,
                LocalDateTimeConverter.class
            )
            .persistenceUnit("booking")
            .properties(properties)
            .build();
    }

    @Bean(name = "transactionManager")
    @Primary
    public PlatformTransactionManager transactionManager(
            @Qualifier("entityManagerFactory") EntityManagerFactory entityManagerFactory) {
        return new JpaTransactionManager(entityManagerFactory);
    }
}
