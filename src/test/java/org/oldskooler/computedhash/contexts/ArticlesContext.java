package org.oldskooler.computedhash.contexts;

import org.oldskooler.computedhash.ModelContext;
import org.oldskooler.computedhash.algorithm.HashAlgorithm;
import org.oldskooler.computedhash.mapping.ModelBuilder;
import org.oldskooler.computedhash.models.Article;

public class ArticlesContext extends ModelContext {
    @Override
    public void onModelCreating(ModelBuilder model) {
        model.entity(Article.class)
                .toTable("Articles")
                .hasId("id", "Id")
                .map("title", "Title")
                .map("content", "Content")
                .map("author", "Author")
                .map("contentHash", "ContentHash")
                .hasColumnType("contentHash", "BINARY(20)")
                .hasComputedHash(Article::getContentHash, HashAlgorithm.SHA1,
                        Article::getTitle, Article::getAuthor)
                .done();
    }
}
