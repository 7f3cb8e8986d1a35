package pro.kaleert.schedimport.service;

public enum InputMode {
    /** Registration page as fetched. */
    HTML,
    /** Schedule copied from the page and pasted as tab-separated text. */
    TEXT
}
