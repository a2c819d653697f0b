package com.docverify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocVerifyApplication {

	public static void main(String[] args) {
        SpringApplication app = new SpringApplication(DocVerifyApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
	}

}
