/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.service.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import net.dagmesh.server.config.ScheduleConfiguration;
import net.dagmesh.server.config.ServerConfiguration;
import net.dagmesh.server.service.GossipService;

@Component
@EnableAsync
public class ScheduleGossipService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleGossipService.class);

    @Autowired
    private GossipService gossipService;
    @Autowired
    private ScheduleConfiguration scheduleConfiguration;
    @Autowired
    ServerConfiguration serverConfiguration;

    @Async
    @Scheduled(fixedDelayString = "${service.schedule.cleanuprate:300000}")
    public void cleanupSeenMessages() {
        if (scheduleConfiguration.isGossip_active() && serverConfiguration.checkService()) {
            try {
                logger.debug(" Start cleanupSeenMessages: ");
                gossipService.cleanupSeenMessages();
            } catch (Exception e) {
                logger.warn("cleanupSeenMessages ", e);
            }
        }
    }

    /*
     * broadcasts whose acknowledgements are overdue go to the fallback nodes
     */
    @Async
    @Scheduled(fixedDelayString = "${service.schedule.ackrate:1000}")
    public void monitorPendingAcks() {
        if (scheduleConfiguration.isGossip_active() && serverConfiguration.checkService()) {
            try {
                gossipService.monitorPendingAcks();
            } catch (Exception e) {
                logger.warn("monitorPendingAcks ", e);
            }
        }
    }
}
