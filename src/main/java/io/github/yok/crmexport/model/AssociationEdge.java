package io.github.yok.crmexport.model;

import lombok.Value;

/**
 * Directed association between two CRM objects.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class AssociationEdge {

    ResourceType fromType;

    String fromId;

    ResourceType toType;

    String toId;
}
