package com.example.org_membershipservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrgMembershipServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrgMembershipServiceApplication.class, args);
    }
}
