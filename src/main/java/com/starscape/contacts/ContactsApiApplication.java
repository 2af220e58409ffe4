package com.starscape.contacts;

import com.starscape.contacts.common.config.ContactsProperties;
import com.starscape.contacts.common.config.RateLimitProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ContactsProperties.class, RateLimitProperties.class})
public class ContactsApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContactsApiApplication.class, args);
    }
}
