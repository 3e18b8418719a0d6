package com.tandem;

import com.tandem.core.security.JwtTokenService;
import com.tandem.core.store.InMemoryTaskStore;
import com.tandem.core.store.ProjectStore;
import com.tandem.core.store.TaskStore;
import com.tandem.dispatch.tools.ToolDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "tandem.projects[0].name=demo",
        "tandem.projects[0].owner-id=3"
})
class TandemApplicationTest {

    @Autowired
    private TaskStore taskStore;

    @Autowired
    private ProjectStore projectStore;

    @Autowired
    private ToolDispatcher toolDispatcher;

    @Autowired
    private JwtTokenService tokenService;

    @Test
    void contextUsesInMemoryStoresWithoutDataSource() {
        assertInstanceOf(InMemoryTaskStore.class, taskStore);
        assertEquals(7, toolDispatcher.toolNames().size());
    }

    @Test
    void configuredProjectsAreSeeded() {
        var demo = projectStore.findByName("demo").orElseThrow();
        assertEquals(3L, demo.ownerId());
    }

    @Test
    void tokenServiceIsBuiltFromConfiguredSecret() {
        String token = tokenService.generateToken(3L, "demo-owner");
        assertEquals("3", tokenService.validateToken(token).getSubject());
    }
}
