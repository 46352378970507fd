package com.di.modelnova;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Model lifecycle service. The datasource is only created by {@link com.di.modelnova.config.PersistenceConfig}
 * when {@code modelnova.persistence-enabled=true}; otherwise every store runs in memory.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@EnableAspectJAutoProxy(proxyTargetClass = false)
@ConfigurationPropertiesScan
public class ModelNovaApplication {

	public static void main(String[] args) {
		SpringApplication.run(ModelNovaApplication.class, args);
	}
}
