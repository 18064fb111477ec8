package com.withdrawalaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WithdrawalAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(WithdrawalAuditApplication.class, args);
    }
}
