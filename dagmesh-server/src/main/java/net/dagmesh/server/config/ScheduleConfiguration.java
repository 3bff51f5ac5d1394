/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ScheduleConfiguration {

    @Value("${service.schedule.gossip:true}")
    boolean gossip_active;
    @Value("${service.schedule.sync:true}")
    boolean sync_active;
    @Value("${service.schedule.prune:false}")
    boolean prune_active;

    public boolean isGossip_active() {
        return gossip_active;
    }

    public void setGossip_active(boolean gossip_active) {
        this.gossip_active = gossip_active;
    }

    public boolean isSync_active() {
        return sync_active;
    }

    public void setSync_active(boolean sync_active) {
        this.sync_active = sync_active;
    }

    public boolean isPrune_active() {
        return prune_active;
    }

    public void setPrune_active(boolean prune_active) {
        this.prune_active = prune_active;
    }
}
