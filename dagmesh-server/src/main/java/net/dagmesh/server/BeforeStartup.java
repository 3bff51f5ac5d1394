/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import net.dagmesh.server.config.ServerConfiguration;
import net.dagmesh.server.net.LoopbackNetwork;
import net.dagmesh.server.service.GossipService;

@Component
public class BeforeStartup {

    private static final Logger logger = LoggerFactory.getLogger(BeforeStartup.class);

    @Autowired
    private ServerConfiguration serverConfiguration;
    @Autowired
    private GossipService gossipService;
    @Autowired
    private LoopbackNetwork loopbackNetwork;

    @PostConstruct
    public void run() {
        logger.debug("server config: " + serverConfiguration.toString());

        if (serverConfiguration.isLoopback()) {
            loopbackNetwork.attach(serverConfiguration.getNodeid(), gossipService);
        }
        if (!gossipService.getPeers().isEmpty()) {
            gossipService.announcePeers();
        }
        serverConfiguration.setServiceOK();
        logger.info("node {} ready with {} peers, {} fallback nodes", serverConfiguration.getNodeid(),
                gossipService.getPeers().size(), gossipService.getFallbackNodes().size());
    }
}
