package com.skillswap.backend.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatis configuration class
 * Mapper XML lives under resources/mapper (see mybatis.mapper-locations)
 */
@Configuration
@MapperScan("com.skillswap.backend.mapper")
public class MyBatisConfig {
}
