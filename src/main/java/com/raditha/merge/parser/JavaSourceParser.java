package com.raditha.merge.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.comments.CommentsCollection;
import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.SourceComment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * {@link SourceParser} backed by JavaParser.
 */
public class JavaSourceParser implements SourceParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaSourceParser.class);

    private final ParserConfiguration configuration;

    /**
     * Create a parser for Java 17 sources.
     */
    public JavaSourceParser() {
        this(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public JavaSourceParser(ParserConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public ParsedSource parse(String content) {
        String text = content == null ? "" : content;
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(text);

        List<String> diagnostics = result.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .toList();
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            logger.debug("Parse failed with {} problem(s)", diagnostics.size());
            return ParsedSource.invalid(text, diagnostics);
        }

        SourceText source = new SourceText(text);
        CompilationUnit cu = result.getResult().get();
        List<Node> nodes = new JavaNodeConverter(source).convert(cu);
        Collection<Comment> rawComments = result.getCommentsCollection()
                .map(CommentsCollection::getComments)
                .map(comments -> (Collection<Comment>) comments)
                .orElseGet(cu::getAllContainedComments);
        List<SourceComment> comments = convertComments(rawComments, source);

        logger.debug("Parsed {} top-level node(s) and {} comment(s)", nodes.size(), comments.size());
        return new ParsedSource(text, source.lines(), true, List.of(), nodes, comments);
    }

    private static List<SourceComment> convertComments(Collection<Comment> rawComments, SourceText source) {
        List<SourceComment> comments = new ArrayList<>();
        for (Comment comment : rawComments) {
            comment.getRange().ifPresent(range -> comments.add(new SourceComment(
                    LineRange.from(range),
                    range.begin.column,
                    source.slice(range),
                    comment.getContent())));
        }
        comments.sort(Comparator.comparingInt(SourceComment::startLine)
                .thenComparingInt(SourceComment::startColumn));
        return comments;
    }
}
