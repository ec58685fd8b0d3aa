package com.example.villages.user.document;

import com.example.villages.authz.model.FamilyRole;
import com.example.villages.authz.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-side projection of a user record. Written by the account features.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "users")
public class UserDoc {

    @Id
    private String id;

    private String email;

    private UserRole role;

    @Indexed
    private String familyId;

    private FamilyRole familyRole;
}
