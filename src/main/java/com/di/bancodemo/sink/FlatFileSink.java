package com.di.bancodemo.sink;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FlatFileSink implements FileSink {

    private final TableFileWriter writer;

    @Override
    public long write(TableWrite write) {
        log.info("[FILES] Writing '{}' as {} to {} (mode={}, layout={})", write.getTableName(), write.getFormat(),
                write.getLocation(), write.getDecision().getMode(), write.getDecision().getLayout());
        return writer.write(write);
    }
}
