package com.di.etlcontrol;

import com.di.etlcontrol.config.EtlSettingsProperties;
import com.di.etlcontrol.monitor.MonitorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ EtlSettingsProperties.class, MonitorProperties.class })
public class EtlControlApplication {

	public static void main(String[] args) {
		SpringApplication.run(EtlControlApplication.class, args);
	}
}
