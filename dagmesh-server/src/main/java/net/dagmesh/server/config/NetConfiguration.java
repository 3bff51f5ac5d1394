/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import net.dagmesh.core.ECKey;
import net.dagmesh.core.Utils;
import net.dagmesh.server.net.LoopbackNetwork;
import net.dagmesh.server.net.Transport;

@Configuration
public class NetConfiguration {
    private static final Logger log = LoggerFactory.getLogger(NetConfiguration.class);

    @Autowired
    ServerConfiguration serverConfiguration;

    @Bean
    public ECKey nodeKey() {
        String privatekey = serverConfiguration.getPrivatekey();
        if (privatekey != null && !privatekey.isEmpty()) {
            return ECKey.fromPrivate(Utils.HEX.decode(privatekey));
        }
        ECKey key = new ECKey();
        log.info("no server.privatekey configured, signing with generated key {}", key.getPublicKeyString());
        return key;
    }

    @Bean
    @ConditionalOnMissingBean
    public LoopbackNetwork loopbackNetwork() {
        return new LoopbackNetwork();
    }

    @Bean
    @ConditionalOnMissingBean
    public Transport transport(LoopbackNetwork loopbackNetwork) {
        return loopbackNetwork.transport(serverConfiguration.getNodeid());
    }
}
