package com.titiplex.mist.core.store;

import com.titiplex.mist.core.crypto.engine.OneTimePrekey;
import com.titiplex.mist.core.crypto.engine.SignedPrekey;
import com.titiplex.mist.core.model.ContactRecord;
import com.titiplex.mist.core.model.PeerKey;

import java.util.List;

public interface Repository {
    void init();

    // Sessions
    void saveSession(StoredSession session);

    List<StoredSession> listSessions();

    void deleteSession(PeerKey peer);

    // Contacts

    boolean insertContactIfAbsent(ContactRecord contact);

    List<ContactRecord> listContacts();

    void deleteContact(PeerKey peer);

    // Prekeys
    void saveSignedPrekey(SignedPrekey prekey);

    List<SignedPrekey> listSignedPrekeys();

    void deleteSignedPrekey(int id);

    void saveOneTimePrekeys(List<OneTimePrekey> prekeys);

    List<OneTimePrekey> listOneTimePrekeys();

    // prekeys pas encore remis dans une invitation
    List<OneTimePrekey> listUnreservedOneTimePrekeys();

    void reserveOneTimePrekey(int id);

    void deleteOneTimePrekey(int id);

    void clear();

    void flush();

    void close();
}
