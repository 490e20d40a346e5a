package com.bteshome.todo.todoservice;

import com.bteshome.todo.storeclient.StoreSettings;
import com.bteshome.todo.todoservice.common.AppSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.bteshome.todo.todoservice", "com.bteshome.todo.storeclient"})
@RequiredArgsConstructor
public class TodoApplication implements CommandLineRunner {
	private final AppSettings appSettings;
	private final StoreSettings storeSettings;

	public static void main(String[] args) {
		SpringApplication.run(TodoApplication.class, args);
	}

	@Override
	public void run(String... args) throws Exception {
		appSettings.print();
		storeSettings.print();
	}
}
