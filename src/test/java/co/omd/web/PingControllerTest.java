package co.omd.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class PingControllerTest {

    @Test
    void answersOk() throws Exception {
        MockMvcBuilders.standaloneSetup(new PingController()).build()
                .perform(get("/api/ping"))
                .andExpect(status().isOk())
                .andExpect(content().string("ok"));
    }
}
