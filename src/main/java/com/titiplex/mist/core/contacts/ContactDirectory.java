package com.titiplex.mist.core.contacts;

import com.titiplex.mist.core.model.ContactRecord;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.store.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class ContactDirectory {
    private static final Logger log = LoggerFactory.getLogger(ContactDirectory.class);

    private final Repository repo;
    private final Map<PeerKey, ContactRecord> contacts = new ConcurrentHashMap<>();

    public ContactDirectory(Repository repo) {
        this.repo = repo;
    }

    public void restore() {
        contacts.clear();
        for (ContactRecord c : repo.listContacts()) contacts.put(c.publicKey(), c);
        log.info("{} contact(s) restored", contacts.size());
    }

    public synchronized boolean addIfAbsent(ContactRecord contact) {
        if (contacts.containsKey(contact.publicKey())) return false;
        boolean inserted = repo.insertContactIfAbsent(contact);
        contacts.put(contact.publicKey(), contact);
        if (inserted) log.info("Contact added: {} ({}, {})", contact.displayName(), contact.publicKey(), contact.trustOrigin());
        return inserted;
    }

    public Optional<ContactRecord> find(PeerKey peer) {
        return Optional.ofNullable(contacts.get(peer));
    }

    public boolean isKnown(PeerKey peer) {
        return contacts.containsKey(peer);
    }

    public List<ContactRecord> list() {
        List<ContactRecord> out = new ArrayList<>(contacts.values());
        out.sort(Comparator.comparingLong(ContactRecord::establishedAt));
        return out;
    }

    public synchronized void remove(PeerKey peer) {
        contacts.remove(peer);
        repo.deleteContact(peer);
    }

    public synchronized void clear() {
        contacts.clear();
    }
}
