package io.github.drompincen.playdeck.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Permission set of a user. {@code periodicTaskIds} are the periodic tasks it relates to.
 */
@Document(collection = "types_permissions")
public class TypesPermissionsDocument {

    @Id
    private String permissionId;
    @Indexed
    private String userId;
    @Indexed
    private Set<String> periodicTaskIds = new LinkedHashSet<>();

    public TypesPermissionsDocument() {}

    public String getPermissionId() { return permissionId; }
    public void setPermissionId(String permissionId) { this.permissionId = permissionId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Set<String> getPeriodicTaskIds() { return periodicTaskIds; }
    public void setPeriodicTaskIds(Set<String> periodicTaskIds) { this.periodicTaskIds = periodicTaskIds; }
}
