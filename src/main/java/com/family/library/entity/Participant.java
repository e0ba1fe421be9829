package com.family.library.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A family member who reads. Parents and children take turns differently,
 * see {@link com.family.library.conversation.RotationCalculator}.
 */
@Entity
@Table(name = "participant", indexes = {
    @Index(name = "idx_participant_name", columnList = "name", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Participant {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "is_parent", nullable = false)
    private boolean parent;
}
