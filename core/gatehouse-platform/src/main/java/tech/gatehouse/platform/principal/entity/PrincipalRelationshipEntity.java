package tech.gatehouse.platform.principal.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * JPA entity for principal_relationships table (directed edges).
 */
@Entity
@Table(name = "principal_relationships")
@IdClass(PrincipalRelationshipEntity.RelationshipId.class)
public class PrincipalRelationshipEntity {

    @Id
    @Column(name = "source_principal_id", length = 17)
    public String sourcePrincipalId;

    @Id
    @Column(name = "target_principal_id", length = 17)
    public String targetPrincipalId;

    @Id
    @Column(name = "relationship_type", length = 50)
    public String relationshipType;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public PrincipalRelationshipEntity() {
    }

    /**
     * Composite primary key for principal_relationships.
     */
    public static class RelationshipId implements Serializable {
        public String sourcePrincipalId;
        public String targetPrincipalId;
        public String relationshipType;

        public RelationshipId() {
        }

        public RelationshipId(String sourcePrincipalId, String targetPrincipalId, String relationshipType) {
            this.sourcePrincipalId = sourcePrincipalId;
            this.targetPrincipalId = targetPrincipalId;
            this.relationshipType = relationshipType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            RelationshipId that = (RelationshipId) o;
            return Objects.equals(sourcePrincipalId, that.sourcePrincipalId) &&
                   Objects.equals(targetPrincipalId, that.targetPrincipalId) &&
                   Objects.equals(relationshipType, that.relationshipType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sourcePrincipalId, targetPrincipalId, relationshipType);
        }
    }
}
