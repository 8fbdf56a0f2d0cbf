package com.fabric.runtime.config;

import com.fabric.shared.state.InMemoryStateSurface;
import com.fabric.shared.state.StateSurface;
import com.fabric.shared.wal.InMemoryWriteAheadLog;
import com.fabric.shared.wal.WriteAheadLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * {@code runtime.storage.mode=memory}: state surface and WAL in process memory, for local runs.
 * Nothing survives a restart; the {@code memory} profile also switches off the datasource.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "runtime.storage.mode", havingValue = "memory")
public class MemoryStorageConfig {

    @Bean
    public StateSurface inMemoryStateSurface(Clock clock) {
        log.warn("State surface is in memory; state is lost on restart");
        return new InMemoryStateSurface(clock);
    }

    @Bean
    public WriteAheadLog inMemoryWriteAheadLog() {
        return new InMemoryWriteAheadLog();
    }
}
