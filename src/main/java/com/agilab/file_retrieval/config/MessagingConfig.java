package com.agilab.file_retrieval.config;

import com.agilab.file_retrieval.FileCheckCommandHandler;
import com.agilab.file_retrieval.event.ExecuteFileCheck;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.Consumer;

/**
 * Inbound binding for {@link ExecuteFileCheck} commands, used by the manual-trigger API.
 * Exceptions thrown here go back to the binder, which redelivers and finally dead-letters the command.
 */
@Configuration
@Slf4j
public class MessagingConfig {

    @Bean
    public Consumer<ExecuteFileCheck> executeFileCheck(FileCheckCommandHandler commandHandler) {
        return command -> {
            log.info("Received file check command for configuration {} of client {} (manual: {}, by {})",
                    command.configurationId(), command.clientId(), command.manualTrigger(), command.triggeredBy());
            commandHandler.handle(command);
        };
    }
}
