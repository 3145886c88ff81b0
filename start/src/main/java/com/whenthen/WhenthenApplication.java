package com.whenthen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * WhenthenApplication - 种子自动化引擎启动入口
 */
@SpringBootApplication(scanBasePackages = "com.whenthen")
public class WhenthenApplication {

    public static void main(String[] args) {
        SpringApplication.run(WhenthenApplication.class, args);
    }
}
