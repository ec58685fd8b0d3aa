package com.example.villages.resource.visibility;

import com.example.villages.authz.model.Viewer;
import com.example.villages.resource.model.ResourceView;
import com.example.villages.resource.model.Visibility;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.example.villages.resource.visibility.VisibilityPredicate.allOf;
import static com.example.villages.resource.visibility.VisibilityPredicate.anyOf;
import static com.example.villages.resource.visibility.VisibilityPredicate.not;

/**
 * Builds the visibility predicate for a viewer.
 *
 * <p>Precedence, first match wins:
 * <ol>
 *   <li>ADMIN sees everything.</li>
 *   <li>The creator sees their own resource.</li>
 *   <li>A MEMBER sees a system-generated resource only when it is assigned to them,
 *       whatever its visibility tier.</li>
 *   <li>Otherwise the tier decides: PUBLIC for everyone, FAMILY for members of the
 *       resource's family, SHARED for users holding a share, PRIVATE for nobody else.</li>
 * </ol>
 * VOLUNTEERs skip step 3.
 */
@Component
public class VisibilityPolicy {

    /**
     * Store lookups a single-resource decision needs before the predicate can be evaluated.
     */
    public enum Lookup {
        ASSIGNMENT,
        SHARE
    }

    public VisibilityPredicate predicateFor(Viewer viewer, VisibilityGrants grants) {
        if (viewer.isAdmin()) {
            return VisibilityPredicate.always();
        }

        VisibilityPredicate own = new VisibilityPredicate.CreatedBy(viewer.userId());
        VisibilityPredicate tier = tierClause(viewer, grants);

        if (viewer.isMember()) {
            VisibilityPredicate systemGenerated = new VisibilityPredicate.SystemGenerated();
            return anyOf(
                    own,
                    allOf(systemGenerated, new VisibilityPredicate.IdIn(grants.assignedResourceIds())),
                    allOf(not(systemGenerated), tier));
        }
        return anyOf(own, tier);
    }

    /**
     * The lookups whose outcome can change the decision for this resource. Empty when
     * the resource fields alone settle it.
     */
    public Set<Lookup> lookupsFor(Viewer viewer, ResourceView resource) {
        Set<Lookup> lookups = EnumSet.noneOf(Lookup.class);
        if (viewer.isAdmin() || resource.isCreatedBy(viewer.userId())) {
            return lookups;
        }
        if (viewer.isMember() && resource.systemGenerated()) {
            lookups.add(Lookup.ASSIGNMENT);
            return lookups;
        }
        if (resource.visibility() == Visibility.SHARED) {
            lookups.add(Lookup.SHARE);
        }
        return lookups;
    }

    private VisibilityPredicate tierClause(Viewer viewer, VisibilityGrants grants) {
        List<VisibilityPredicate> tiers = new ArrayList<>();
        tiers.add(new VisibilityPredicate.VisibilityIs(Visibility.PUBLIC));
        if (viewer.hasFamily()) {
            tiers.add(allOf(
                    new VisibilityPredicate.VisibilityIs(Visibility.FAMILY),
                    new VisibilityPredicate.FamilyIs(viewer.familyId())));
        }
        tiers.add(allOf(
                new VisibilityPredicate.VisibilityIs(Visibility.SHARED),
                new VisibilityPredicate.IdIn(grants.sharedResourceIds())));
        return anyOf(tiers);
    }
}
