/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core;

public enum NodeType {
    BLOCK, CHECKPOINT, MERGE
}
