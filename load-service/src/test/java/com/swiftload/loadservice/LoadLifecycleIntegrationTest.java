package com.swiftload.loadservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swiftload.loadservice.model.OutboxEvent;
import com.swiftload.loadservice.repository.BidRepository;
import com.swiftload.loadservice.repository.LoadRepository;
import com.swiftload.loadservice.repository.MessageRepository;
import com.swiftload.loadservice.repository.OutboxRepository;
import com.swiftload.loadservice.repository.SavedLoadRepository;
import com.swiftload.loadservice.repository.UserAccountRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End to end over HTTP and PostgreSQL: post, bid, accept, message, deliver.
 */
@AutoConfigureMockMvc
class LoadLifecycleIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private LoadRepository loadRepository;
    @Autowired
    private BidRepository bidRepository;
    @Autowired
    private MessageRepository messageRepository;
    @Autowired
    private SavedLoadRepository savedLoadRepository;
    @Autowired
    private UserAccountRepository userAccountRepository;
    @Autowired
    private OutboxRepository outboxRepository;

    private UUID shipperId;
    private UUID trucker1Id;
    private UUID trucker2Id;
    private UUID outsiderId;

    @BeforeEach
    void setUp() throws Exception {
        shipperId = UUID.randomUUID();
        trucker1Id = UUID.randomUUID();
        trucker2Id = UUID.randomUUID();
        outsiderId = UUID.randomUUID();

        // first call to /users/me creates each profile
        for (Map.Entry<UUID, String> user : Map.of(
                shipperId, "SHIPPER", trucker1Id, "TRUCKER", trucker2Id, "TRUCKER", outsiderId, "TRUCKER").entrySet()) {
            mockMvc.perform(get("/api/v1/users/me").with(as(user.getKey(), user.getValue())))
                    .andExpect(status().isOk());
        }
    }

    @AfterEach
    void cleanup() {
        messageRepository.deleteAll();
        savedLoadRepository.deleteAll();
        bidRepository.deleteAll();
        loadRepository.deleteAll();
        userAccountRepository.deleteAll();
        outboxRepository.deleteAll();
    }

    private JwtRequestPostProcessor as(UUID userId, String role) {
        return jwt().jwt(builder -> builder
                .subject(userId.toString())
                .claim("email", role.toLowerCase() + "@example.com")
                .claim("resource_access", Map.of("swiftload-backend", Map.of("roles", List.of(role)))));
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String postLoad() throws Exception {
        String json = """
                {"title": "Dry van, beverages", "pickupCity": "Milwaukee", "pickupState": "WI",
                 "deliveryCity": "St. Louis", "deliveryState": "MO", "equipment": "Dry Van",
                 "weightLbs": 42000, "rate": 1650.00}
                """;
        MvcResult result = mockMvc.perform(post("/api/v1/loads")
                        .with(as(shipperId, "SHIPPER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andReturn();
        return body(result).get("id").asText();
    }

    private String placeBid(String loadId, UUID truckerId, String amount) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/loads/" + loadId + "/bids")
                        .with(as(truckerId, "TRUCKER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": " + amount + "}"))
                .andExpect(status().isCreated())
                .andReturn();
        return body(result).get("id").asText();
    }

    @Test
    void should_run_a_load_from_posting_to_completion() throws Exception {
        String loadId = postLoad();
        String t1Bid = placeBid(loadId, trucker1Id, "500.00");
        String t2Bid = placeBid(loadId, trucker2Id, "450.00");

        // owner sees both, cheapest first
        mockMvc.perform(get("/api/v1/loads/" + loadId + "/bids").with(as(shipperId, "SHIPPER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(t2Bid))
                .andExpect(jsonPath("$[1].id").value(t1Bid));

        mockMvc.perform(post("/api/v1/loads/" + loadId + "/bids/" + t2Bid + "/accept").with(as(shipperId, "SHIPPER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ASSIGNED"))
                .andExpect(jsonPath("$.assignedTruckerId").value(trucker2Id.toString()));

        // retrying the accept is rejected
        mockMvc.perform(post("/api/v1/loads/" + loadId + "/bids/" + t2Bid + "/accept").with(as(shipperId, "SHIPPER")))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(get("/api/v1/bids/mine").with(as(trucker1Id, "TRUCKER")))
                .andExpect(jsonPath("$[0].status").value("REJECTED"));

        mockMvc.perform(post("/api/v1/loads/" + loadId + "/in-transit").with(as(trucker2Id, "TRUCKER")))
                .andExpect(jsonPath("$.status").value("IN_TRANSIT"));
        mockMvc.perform(post("/api/v1/loads/" + loadId + "/complete").with(as(shipperId, "SHIPPER")))
                .andExpect(jsonPath("$.status").value("COMPLETED"));

        mockMvc.perform(post("/api/v1/loads/" + loadId + "/cancel").with(as(shipperId, "SHIPPER")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("INVALID_LOAD_STATE"));

        assertThat(outboxRepository.findAll()).extracting(OutboxEvent::getType)
                .contains("load.posted", "bid.placed", "load.assigned", "load.in_transit", "load.completed");
    }

    @Test
    void should_reject_cancel_by_another_shipper() throws Exception {
        String loadId = postLoad();
        UUID otherShipper = UUID.randomUUID();

        mockMvc.perform(post("/api/v1/loads/" + loadId + "/cancel").with(as(otherShipper, "SHIPPER")))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/loads/" + loadId).with(as(otherShipper, "SHIPPER")))
                .andExpect(jsonPath("$.status").value("OPEN"));
    }

    @Test
    void should_limit_messaging_to_parties_of_the_load() throws Exception {
        String loadId = postLoad();
        placeBid(loadId, trucker1Id, "500.00");

        mockMvc.perform(post("/api/v1/loads/" + loadId + "/messages")
                        .with(as(trucker1Id, "TRUCKER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\": \"" + shipperId + "\", \"body\": \"Can load at 6am.\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/loads/" + loadId + "/messages")
                        .with(as(outsiderId, "TRUCKER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\": \"" + shipperId + "\", \"body\": \"Still available?\"}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/loads/" + loadId + "/messages").with(as(shipperId, "SHIPPER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].body").value("Can load at 6am."));

        mockMvc.perform(get("/api/v1/loads/" + loadId + "/messages").with(as(outsiderId, "TRUCKER")))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/messages/inbox").with(as(shipperId, "SHIPPER")))
                .andExpect(jsonPath("$.content[0].senderId").value(trucker1Id.toString()));
    }

    @Test
    void should_forbid_outsider_messaging_a_shipper_without_a_profile() throws Exception {
        UUID newShipper = UUID.randomUUID();
        MvcResult posted = mockMvc.perform(post("/api/v1/loads")
                        .with(as(newShipper, "SHIPPER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Flatbed, steel coils\", \"pickupCity\": \"Gary\", "
                                + "\"deliveryCity\": \"Louisville\", \"rate\": 2100.00}"))
                .andExpect(status().isCreated())
                .andReturn();
        String loadId = body(posted).get("id").asText();

        mockMvc.perform(post("/api/v1/loads/" + loadId + "/messages")
                        .with(as(outsiderId, "TRUCKER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\": \"" + newShipper + "\", \"body\": \"Any room left?\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("ACCESS_DENIED"));
    }

    @Test
    void should_toggle_saved_loads() throws Exception {
        String loadId = postLoad();

        mockMvc.perform(post("/api/v1/saved-loads/" + loadId + "/toggle").with(as(trucker1Id, "TRUCKER")))
                .andExpect(jsonPath("$.saved").value(true));
        mockMvc.perform(get("/api/v1/saved-loads").with(as(trucker1Id, "TRUCKER")))
                .andExpect(jsonPath("$[0].id").value(loadId));
        mockMvc.perform(post("/api/v1/saved-loads/" + loadId + "/toggle").with(as(trucker1Id, "TRUCKER")))
                .andExpect(jsonPath("$.saved").value(false));
    }

    @Test
    void should_search_open_loads_by_lane() throws Exception {
        postLoad();

        mockMvc.perform(get("/api/v1/loads")
                        .param("pickupCity", "milw")
                        .param("status", "OPEN")
                        .with(as(trucker1Id, "TRUCKER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].deliveryCity").value("St. Louis"));

        mockMvc.perform(get("/api/v1/loads")
                        .param("deliveryCity", "Denver")
                        .with(as(trucker1Id, "TRUCKER")))
                .andExpect(jsonPath("$.length()").value(0));
    }
}
