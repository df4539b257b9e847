package com.titiplex.mist;

import com.titiplex.mist.core.orchestrator.SessionOrchestrator;
import com.titiplex.mist.ui.ConsoleController;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

public class App {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(SpringConfig.class)
                .web(WebApplicationType.NONE)
                .run(args);
        context.registerShutdownHook();

        context.getBean(SessionOrchestrator.class).start();
        context.getBean(ConsoleController.class).run(System.in, System.out);
        context.close();
    }
}
