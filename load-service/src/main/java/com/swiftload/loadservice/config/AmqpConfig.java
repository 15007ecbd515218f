package com.swiftload.loadservice.config;

import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AmqpConfig {

    public static final String LOAD_EXCHANGE = "load_events_exchange";

    // Producer only: consumers declare and bind their own queues (load.#, bid.#)

    @Bean
    public TopicExchange loadEventsExchange() {
        return new TopicExchange(LOAD_EXCHANGE);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
