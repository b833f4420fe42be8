package com.work.lock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：多实例部署时，受保护的定时任务同一时刻只在一个实例上执行。
 */
@SpringBootApplication
@EnableScheduling
public class JobLockApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobLockApplication.class, args);
    }
}
