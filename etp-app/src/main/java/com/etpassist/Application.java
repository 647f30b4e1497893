package com.etpassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ETP 对话助手应用启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到各子模块中的组件。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-10
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
