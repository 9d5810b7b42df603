package com.example.jobscheduler.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.*;

/**
 * 内部用户身份，externalUserId 为外部认证系统的用户 id。
 */
@Entity
@Table(name = "users", indexes = {@Index(name = "idx_users_external", columnList = "external_user_id", unique = true)})
@Getter @Setter @ToString
public class UserAccount {
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "external_user_id", length = 128, nullable = false)
    private String externalUserId;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "role", length = 32)
    private String role;
}
