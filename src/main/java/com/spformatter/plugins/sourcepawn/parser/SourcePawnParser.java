package com.spformatter.plugins.sourcepawn.parser;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.spformatter.syntax.ParseFailureException;
import com.spformatter.syntax.SourceParser;
import com.spformatter.syntax.SourceText;
import com.spformatter.syntax.SyntaxNode;
import com.spformatter.syntax.SyntaxTree;
import com.spformatter.util.LoggerUtil;

/**
 * SourcePawn parser behind the {@link SourceParser} boundary.
 * Every parse runs under the parser lock, so one instance is never used by two threads at once.
 */
public class SourcePawnParser implements SourceParser {
    private static final Logger logger = LoggerUtil.getLogger(SourcePawnParser.class);
    private static final int LOCK_TIMEOUT_SEC = 10;

    private final Lock parserLock = new ReentrantLock();
    private final AtomicInteger parseCount = new AtomicInteger(0);
    private volatile boolean closed = false;

    @Override
    public SyntaxTree parse(String source) {
        if (closed) {
            throw new IllegalStateException("SourcePawn parser has been closed");
        }
        if (source == null || source.isEmpty()) {
            return null;
        }

        if (!acquireLock()) {
            throw new ParseFailureException("Timed out waiting for parser access");
        }

        parseCount.incrementAndGet();
        try {
            List<Token> tokens = new Lexer(source).tokenize();
            SourceText text = new SourceText(source);
            SyntaxNode root = new SourcePawnGrammar(text, tokens).parseSourceFile();
            return new SyntaxTree(text, root);
        } catch (ParseFailureException e) {
            logger.warning(e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Grammar failure while parsing source", e);
            throw new ParseFailureException("Unable to parse source code: " + e.getMessage(), e);
        } catch (StackOverflowError e) {
            logger.warning("Parser stack exhausted");
            throw new ParseFailureException("Unable to parse source code: nesting too deep", e);
        } finally {
            parserLock.unlock();
        }
    }

    private boolean acquireLock() {
        try {
            return parserLock.tryLock(LOCK_TIMEOUT_SEC, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int getParseCount() {
        return parseCount.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (acquireLock()) {
            try {
                closed = true;
                logger.fine("SourcePawn parser closed after " + parseCount.get() + " parses");
            } finally {
                parserLock.unlock();
            }
        } else {
            closed = true;
            logger.warning("Could not acquire lock to close parser; marking closed");
        }
    }
}
