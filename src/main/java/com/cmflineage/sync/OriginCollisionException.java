package com.cmflineage.sync;

import com.cmflineage.identity.NodeId;
import com.cmflineage.store.LineageException;

public class OriginCollisionException extends LineageException {
    public OriginCollisionException(NodeId origin, String knownUuid, String incomingUuid) {
        super("Execution origin " + origin + " is already bound to execution " + knownUuid
                + " but the batch carries execution " + incomingUuid + "; two stores share the id " + origin.storeId());
    }
}
