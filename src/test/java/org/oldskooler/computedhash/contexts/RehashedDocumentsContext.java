package org.oldskooler.computedhash.contexts;

import org.oldskooler.computedhash.ModelContext;
import org.oldskooler.computedhash.algorithm.HashAlgorithm;
import org.oldskooler.computedhash.mapping.ModelBuilder;
import org.oldskooler.computedhash.models.Document;

/**
 * ContentHash moves from SHA2_512 to SHA2_256.
 */
public class RehashedDocumentsContext extends ModelContext {
    @Override
    public void onModelCreating(ModelBuilder model) {
        model.entity(Document.class)
                .hasComputedHash("contentHash", HashAlgorithm.SHA2_256, "title", "content")
                .done();
    }
}
