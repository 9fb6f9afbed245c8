package io.netloom.topology.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ExternalTopologyBindingTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void bindsSnakeCaseKeysAndIgnoresUnknownOnes() throws Exception {
        String json = """
            {
              "meta": {"id": "lab", "name": "Lab", "owner": "ignored"},
              "defaults": {"ip_forwarding": true, "sysctl": {"net.ipv4.conf.all.rp_filter": 0},
                           "vbox": {"paravirt_provider": "kvm"}},
              "links": [{"endpoints": ["R1", "R2"]}],
              "nodes": [{
                "name": "R1",
                "role": "router",
                "interfaces": [{"ip": "10.0.1.1/24"}],
                "routing": {"engine": "bird", "router_id": "1.1.1.1", "static": ["10.9.0.0/16 via 10.0.1.2"]},
                "services": {"http_server": 8080,
                             "wireguard": {"private_key": "k", "listen_port": 51820, "address": "10.99.0.1/24",
                                           "peers": [{"public_key": "p", "allowed_ips": "10.99.0.2/32"}]}},
                "colour": "blue"
              }]
            }
            """;

        ExternalTopology topology = mapper.readValue(json, ExternalTopology.class);

        assertEquals("lab", topology.meta().id());
        assertTrue(topology.defaults().ipForwarding());
        assertEquals(0, topology.defaults().sysctl().get("net.ipv4.conf.all.rp_filter"));
        assertEquals("kvm", topology.defaults().vbox().paravirtProvider());
        assertEquals(LinkDeclaration.between("R1", "R2"), topology.links().get(0));

        ExternalNode r1 = topology.node("R1").orElseThrow();
        assertEquals("1.1.1.1", r1.routing().routerId());
        assertEquals("10.9.0.0/16 via 10.0.1.2", r1.routing().staticRoutes().get(0));
        assertEquals(8080, r1.services().httpServer());
        assertEquals("10.99.0.2/32", r1.services().wireguard().peers().get(0).allowedIps());
        assertNull(r1.interfaces().get(0).configured());
        assertTrue(r1.vlans().isEmpty());
    }

    @Test
    void absentCollectionsBecomeEmpty() {
        ExternalTopology topology = new ExternalTopology(new Meta("t", "T", null), null, null, null);

        assertTrue(topology.links().isEmpty());
        assertTrue(topology.nodes().isEmpty());
        assertTrue(topology.node("R1").isEmpty());
    }
}
