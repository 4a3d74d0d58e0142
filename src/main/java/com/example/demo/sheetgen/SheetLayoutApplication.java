package com.example.demo.sheetgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetLayoutApplication {

	public static void main(String[] args) {
		SpringApplication.run(SheetLayoutApplication.class, args);
	}

}
