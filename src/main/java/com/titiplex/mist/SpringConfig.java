package com.titiplex.mist;

import com.titiplex.mist.core.crypto.engine.CryptoEngine;
import com.titiplex.mist.core.crypto.engine.Curve25519CryptoEngine;
import com.titiplex.mist.core.loop.EventLoop;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan(basePackages = "com.titiplex.mist")
public class SpringConfig {

    @Bean(destroyMethod = "shutdown")
    public EventLoop eventLoop() {
        return new EventLoop("mist-loop");
    }

    @Bean
    public CryptoEngine cryptoEngine() {
        return new Curve25519CryptoEngine();
    }
}
