package com.codeheadsystems.cipherscore.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cipherscore")
public class CipherScoreProperties {

  private String backend = "PAILLIER";
  private int paillierKeyBits = 2048;
  private String keySeedHex = "";
  private String ownerIdentity = "";
  private String serviceIdentity = "cipherscore-oracle";

  public String getBackend() {
    return backend;
  }

  public void setBackend(String backend) {
    this.backend = backend;
  }

  public int getPaillierKeyBits() {
    return paillierKeyBits;
  }

  public void setPaillierKeyBits(int paillierKeyBits) {
    this.paillierKeyBits = paillierKeyBits;
  }

  public String getKeySeedHex() {
    return keySeedHex;
  }

  public void setKeySeedHex(String keySeedHex) {
    this.keySeedHex = keySeedHex;
  }

  public String getOwnerIdentity() {
    return ownerIdentity;
  }

  public void setOwnerIdentity(String ownerIdentity) {
    this.ownerIdentity = ownerIdentity;
  }

  public String getServiceIdentity() {
    return serviceIdentity;
  }

  public void setServiceIdentity(String serviceIdentity) {
    this.serviceIdentity = serviceIdentity;
  }
}
