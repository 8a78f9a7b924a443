package com.wayfinder.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class McpWorkerConnectionFactory implements WorkerConnectionFactory {

    private final WorkerProperties props;
    private final ObjectMapper mapper;

    public McpWorkerConnectionFactory(WorkerProperties props, ObjectMapper mapper) {
        this.props = props;
        this.mapper = mapper;
    }

    @Override
    public WorkerConnection create(String sessionId) {
        return new McpWorkerConnection(sessionId, props, mapper);
    }
}
