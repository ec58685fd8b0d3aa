package com.example.villages.authz.rules;

import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.AccessRule;
import com.example.villages.authz.model.ResourceType;

import static com.example.villages.authz.condition.AccessCondition.and;
import static com.example.villages.authz.condition.AccessCondition.isAdmin;
import static com.example.villages.authz.condition.AccessCondition.isFamilyAdmin;
import static com.example.villages.authz.condition.AccessCondition.isFamilyMember;
import static com.example.villages.authz.condition.AccessCondition.isOwner;
import static com.example.villages.authz.condition.AccessCondition.isPublic;

/**
 * Built-in rule tables, one per {@link ResourceType}.
 */
public final class DefaultRuleSets {

    private DefaultRuleSets() {
    }

    public static RuleSetRegistry registry() {
        return RuleSetRegistry.builder()
                .register(ResourceType.DOCUMENT,
                        AccessRule.of(isAdmin(), AccessLevel.ADMIN,
                                "System administrators have full access to all documents"),
                        AccessRule.of(isOwner(), AccessLevel.DELETE,
                                "Document owners have full access to their documents"),
                        AccessRule.of(and(isFamilyAdmin(), isFamilyMember()), AccessLevel.WRITE,
                                "Family administrators can edit documents within their family"),
                        AccessRule.of(isFamilyMember(), AccessLevel.READ,
                                "Family members can view documents within their family"),
                        AccessRule.of(isPublic(), AccessLevel.READ,
                                "Anyone can view public documents"))
                .register(ResourceType.MESSAGE,
                        AccessRule.of(isAdmin(), AccessLevel.ADMIN,
                                "System administrators have full access to all messages"),
                        AccessRule.of(isOwner(), AccessLevel.DELETE,
                                "Message senders can edit and delete their messages"),
                        AccessRule.of(isFamilyMember(), AccessLevel.READ,
                                "Family members can view messages in their family conversations"))
                // isFamilyAdmin is deliberately not paired with isFamilyMember in the FAMILY and
                // USER tables: a family admin of any family matches. Pending a product decision.
                .register(ResourceType.FAMILY,
                        AccessRule.of(isAdmin(), AccessLevel.ADMIN,
                                "System administrators have full access to all families"),
                        AccessRule.of(isOwner(), AccessLevel.DELETE,
                                "Family creators have full access to their families"),
                        AccessRule.of(isFamilyAdmin(), AccessLevel.WRITE,
                                "Family administrators can manage their family"),
                        AccessRule.of(isFamilyMember(), AccessLevel.READ,
                                "Family members can view their family information"))
                .register(ResourceType.USER,
                        AccessRule.of(isAdmin(), AccessLevel.ADMIN,
                                "System administrators have full access to all users"),
                        AccessRule.of(isOwner(), AccessLevel.WRITE,
                                "Users can edit their own profile"),
                        AccessRule.of(isFamilyAdmin(), AccessLevel.READ,
                                "Family administrators can view their family members"),
                        AccessRule.of(isFamilyMember(), AccessLevel.READ,
                                "Family members can view other family members"))
                .register(ResourceType.NOTIFICATION,
                        AccessRule.of(isAdmin(), AccessLevel.ADMIN,
                                "System administrators have full access to all notifications"),
                        AccessRule.of(isOwner(), AccessLevel.DELETE,
                                "Users have full access to their own notifications"))
                .register(ResourceType.CARE_PLAN,
                        AccessRule.of(isAdmin(), AccessLevel.ADMIN,
                                "System administrators have full access to all care plans"),
                        AccessRule.of(isOwner(), AccessLevel.DELETE,
                                "Care plan creators have full access to their plans"),
                        AccessRule.of(and(isFamilyAdmin(), isFamilyMember()), AccessLevel.WRITE,
                                "Family administrators can manage care plans within their family"),
                        AccessRule.of(isFamilyMember(), AccessLevel.READ,
                                "Family members can view care plans within their family"))
                .register(ResourceType.ACTIVITY,
                        AccessRule.of(isAdmin(), AccessLevel.ADMIN,
                                "System administrators have full access to all activities"),
                        AccessRule.of(isOwner(), AccessLevel.DELETE,
                                "Activity creators have full access to their activities"),
                        AccessRule.of(isFamilyMember(), AccessLevel.READ,
                                "Family members can view activities within their family"))
                .register(ResourceType.RESOURCE,
                        AccessRule.of(isAdmin(), AccessLevel.ADMIN,
                                "System administrators have full access to all resources"),
                        AccessRule.of(isOwner(), AccessLevel.DELETE,
                                "Resource creators can edit and delete their resources"),
                        AccessRule.of(isFamilyMember(), AccessLevel.READ,
                                "Family members can view resources within their family"),
                        AccessRule.of(isPublic(), AccessLevel.READ,
                                "Anyone can view public resources"))
                .build();
    }
}
