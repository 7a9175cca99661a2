package org.oldskooler.computedhash.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.oldskooler.computedhash.algorithm.HashAlgorithm;
import org.oldskooler.computedhash.annotations.Column;
import org.oldskooler.computedhash.annotations.ComputedHash;
import org.oldskooler.computedhash.annotations.Entity;
import org.oldskooler.computedhash.annotations.Id;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Entity(table = "Documents")
public class Document {
    @Id(name = "Id")
    private Integer id;

    @Column(name = "Title", nullable = false, length = 200)
    private String title;

    @Column(name = "Content", type = "NVARCHAR(MAX)")
    private String content;

    @Column(name = "LastModified")
    private LocalDateTime lastModified;

    @Column(name = "ContentHash")
    @ComputedHash(method = HashAlgorithm.SHA2_512, sources = {"title", "content"})
    private byte[] contentHash;

    @Column(name = "VersionHash")
    @ComputedHash(algorithm = "sha2_256", sources = {"content", "lastModified"})
    private byte[] versionHash;
}
