package com.whenthen.infrastructure.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatisPlusConfig - MyBatis-Plus 配置
 * <p>
 * 只负责扫描 playlet / task 两个 mapper 包，其余由 starter 自动完成。
 * </p>
 */
@Configuration
@MapperScan("com.whenthen.infrastructure.persistence.**.mapper")
public class MyBatisPlusConfig {
}
