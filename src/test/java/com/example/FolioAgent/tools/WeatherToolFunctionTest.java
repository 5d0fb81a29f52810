package com.example.FolioAgent.tools;

import com.example.FolioAgent.config.AgentProperties;
import com.example.FolioAgent.config.ToolClientConfig;
import com.example.FolioAgent.model.Intent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WeatherToolFunctionTest {

    private MockRestServiceServer server;
    private WeatherToolFunction function;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getTools().getWeather().setLocationName("Seattle");
        properties.getTools().getWeather().setLatitude(47.6);
        properties.getTools().getWeather().setLongitude(-122.3);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        function = new WeatherToolFunction(new ToolClientConfig().weatherRestClient(builder, properties), properties);
    }

    @Test
    void readsCurrentConditions() {
        server.expect(requestTo("https://api.open-meteo.com/v1/forecast?latitude=47.6&longitude=-122.3&current_weather=true"))
                .andRespond(withSuccess("""
                        {"current_weather": {"temperature": 11.4, "windspeed": 7.2, "weathercode": 3,
                                             "time": "2026-10-18T09:00"}}
                        """, MediaType.APPLICATION_JSON));

        WeatherToolFunction.Response response = function.invoke(new ToolRequest("weather?", Intent.GENERAL));

        assertThat(response.location()).isEqualTo("Seattle");
        assertThat(response.temperatureC()).isEqualTo(11.4);
        assertThat(response.weatherCode()).isEqualTo(3);
    }

    @Test
    void missingCurrentBlockIsAProviderFailure() {
        server.expect(requestTo("https://api.open-meteo.com/v1/forecast?latitude=47.6&longitude=-122.3&current_weather=true"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> function.invoke(new ToolRequest("weather?", Intent.GENERAL)))
                .isInstanceOf(IllegalStateException.class);
    }
}
