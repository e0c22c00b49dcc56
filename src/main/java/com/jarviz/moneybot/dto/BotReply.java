package com.jarviz.moneybot.dto;

/**
 * What the bot sends back for one incoming message: a text, a file or nothing.
 */
public class BotReply {

    private final String text;
    private final byte[] document;
    private final String fileName;

    private BotReply(String text, byte[] document, String fileName) {
        this.text = text;
        this.document = document;
        this.fileName = fileName;
    }

    public static BotReply text(String text) {
        return new BotReply(text, null, null);
    }

    public static BotReply document(byte[] content, String fileName) {
        return new BotReply(null, content, fileName);
    }

    public static BotReply none() {
        return new BotReply(null, null, null);
    }

    public boolean isEmpty() {
        return text == null && document == null;
    }

    public boolean isDocument() {
        return document != null;
    }

    public String getText() {
        return text;
    }

    public byte[] getDocument() {
        return document;
    }

    public String getFileName() {
        return fileName;
    }
}
