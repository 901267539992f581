package com.slb.fleet_backend;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.slb.fleet_backend")
@MapperScan("com.slb.fleet_backend.modules.*.mapper")
@EnableCaching
@EnableScheduling
public class FleetBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(FleetBackendApplication.class, args);
	}

}
