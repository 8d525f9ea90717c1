package org.tessera.runtime.cluster;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.tessera.runtime.exceptions.ParseException;
import org.tessera.util.Host;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PeerParserTest {

    @Test
    public void emptyPeerListParses() {
        PeerParser parser = PeerParser.parse("12,3000,[]", Collections.emptyMap());

        assertThat(parser.getGeneration()).isEqualTo(12L);
        assertThat(parser.getDefaultPort()).isEqualTo(3000);
        assertThat(parser.getPeers()).isEmpty();
    }

    @Test
    public void peersWithHostsParse() {
        PeerParser parser = PeerParser.parse(
                "7,3000,[[BB9,,[10.0.0.2:3001,10.0.0.12]],[BB7,tls-b,[[fe80::2]:3002]]]",
                Collections.emptyMap());

        assertThat(parser.getGeneration()).isEqualTo(7L);
        assertThat(parser.getPeers()).hasSize(2);

        Peer first = parser.getPeers().get(0);
        assertThat(first.getNodeName()).isEqualTo("BB9");
        assertThat(first.getTlsName()).isNull();
        assertThat(first.getHosts()).containsExactly(new Host("10.0.0.2", 3001), new Host("10.0.0.12", 3000));

        Peer second = parser.getPeers().get(1);
        assertThat(second.getTlsName()).isEqualTo("tls-b");
        assertThat(second.getHosts()).containsExactly(new Host("fe80::2", 3002));
        assertThat(second.getHosts().get(0).getTlsName()).isEqualTo("tls-b");
    }

    @Test
    public void ipMapTranslatesHosts() {
        PeerParser parser = PeerParser.parse("1,3000,[[BB9,,[192.168.1.2:3000]]]",
                ImmutableMap.of("192.168.1.2", "10.0.0.2"));

        assertThat(parser.getPeers().get(0).getHosts()).containsExactly(new Host("10.0.0.2", 3000));
    }

    @Test
    public void malformedResponsesThrow() {
        assertThatThrownBy(() -> PeerParser.parse("", Collections.emptyMap()))
                .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> PeerParser.parse("x,3000,[]", Collections.emptyMap()))
                .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> PeerParser.parse("1,3000,[[BB9,,[10.0.0.2:3000]", Collections.emptyMap()))
                .isInstanceOf(ParseException.class);
    }
}
