package com.hilo.market;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HiLoMarketApplication {

    public static void main(String[] args) {
        SpringApplication.run(HiLoMarketApplication.class, args);
    }

}
