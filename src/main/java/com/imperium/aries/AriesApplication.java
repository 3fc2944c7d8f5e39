package com.imperium.aries;

import com.imperium.aries.config.DotenvLoader;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@MapperScan("com.imperium.aries.mapper")
public class AriesApplication {

    public static void main(String[] args) {
        DotenvLoader.load(); // .env 中的数据库、SMTP、JWT 密钥等写入系统属性，供 application.yaml 占位符解析
        SpringApplication.run(AriesApplication.class, args);
    }
}
